package io.a2a.extras.taskengine.handler;

/**
 * JSON-RPC error codes used by the A2A protocol.
 */
public interface A2aErrorCodes {
    int TASK_NOT_FOUND_ERROR_CODE = -32001;
    int TASK_NOT_CANCELABLE_ERROR_CODE = -32002;
    int METHOD_NOT_FOUND_ERROR_CODE = -32601;
    int INVALID_PARAMS_ERROR_CODE = -32602;
    int INTERNAL_ERROR_CODE = -32603;
}
