package com.sluice.internal.http;

/**
 * One header line as it appeared on the wire.
 */
record Header(String name, String value) {
}
