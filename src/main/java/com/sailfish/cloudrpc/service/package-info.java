/**
 * Service interfaces of the execution core: the {@link com.sailfish.cloudrpc.service.CompletionQueue}
 * and the {@link com.sailfish.cloudrpc.service.RpcExecutionService} offered to the client layers.
 */
package com.sailfish.cloudrpc.service;
