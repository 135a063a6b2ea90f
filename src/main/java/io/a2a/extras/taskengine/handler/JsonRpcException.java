package io.a2a.extras.taskengine.handler;

import io.a2a.extras.taskengine.storage.InvalidStateTransitionException;
import io.a2a.extras.taskengine.storage.NotFoundException;
import io.a2a.extras.taskengine.storage.ValidationException;

/**
 * A failed JSON-RPC call, carrying the error code the transport puts in the response envelope.
 */
public class JsonRpcException extends RuntimeException {

    private final int code;

    public JsonRpcException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static JsonRpcException methodNotFound(String method) {
        return new JsonRpcException(A2aErrorCodes.METHOD_NOT_FOUND_ERROR_CODE, "Method not found: " + method, null);
    }

    public static JsonRpcException invalidParams(String message, Throwable cause) {
        return new JsonRpcException(A2aErrorCodes.INVALID_PARAMS_ERROR_CODE, message, cause);
    }

    /**
     * Maps an engine failure to its protocol error code; anything unexpected is an internal error.
     */
    public static JsonRpcException from(RuntimeException error) {
        if (error instanceof JsonRpcException rpc) {
            return rpc;
        }
        if (error instanceof NotFoundException) {
            return new JsonRpcException(A2aErrorCodes.TASK_NOT_FOUND_ERROR_CODE, error.getMessage(), error);
        }
        if (error instanceof InvalidStateTransitionException) {
            return new JsonRpcException(A2aErrorCodes.TASK_NOT_CANCELABLE_ERROR_CODE, error.getMessage(), error);
        }
        if (error instanceof ValidationException || error instanceof IllegalArgumentException) {
            return invalidParams(error.getMessage(), error);
        }
        return new JsonRpcException(A2aErrorCodes.INTERNAL_ERROR_CODE, "Internal error", error);
    }
}
