/**
 * Pure Java value types shared across all Steward modules.
 *
 * <p>{@link com.libragraph.steward.types.LifecycleState} and
 * {@link com.libragraph.steward.types.TriggerEvent} live here so that observers and
 * stream gates can depend on the lifecycle vocabulary without pulling in the core.
 * This module has no framework dependencies.
 */
package com.libragraph.steward.types;
