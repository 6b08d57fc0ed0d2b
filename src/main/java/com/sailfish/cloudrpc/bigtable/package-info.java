/**
 * Value types used to describe table administration calls: table configuration, column family
 * changes, garbage collection rules and app profile routing.
 */
package com.sailfish.cloudrpc.bigtable;
