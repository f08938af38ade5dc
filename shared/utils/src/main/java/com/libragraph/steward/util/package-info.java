/**
 * Shared utilities for all Steward modules.
 *
 * <p>Contains {@link com.libragraph.steward.util.Mailbox}, the single-writer serial
 * executor every coordinating entity is built on. No framework dependencies, pure Java.
 */
package com.libragraph.steward.util;
