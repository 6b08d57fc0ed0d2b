/**
 * Object storage helpers: RFC 3339 timestamps and credentials for the Authorization header.
 */
package com.sailfish.cloudrpc.storage;
