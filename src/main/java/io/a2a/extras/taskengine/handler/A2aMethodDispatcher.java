package io.a2a.extras.taskengine.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.a2a.extras.taskengine.jdbc.JsonUtils;
import io.a2a.extras.taskengine.model.TaskPushNotificationConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Routes a JSON-RPC method name and its {@code params} node to {@link A2aRequestHandler}.
 * The JSON-RPC envelope itself belongs to the transport.
 */
@Slf4j
public class A2aMethodDispatcher {

    private final ObjectMapper objectMapper = JsonUtils.OBJECT_MAPPER.copy()
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
    private final Map<String, Function<JsonNode, Object>> routes = new HashMap<>();

    public A2aMethodDispatcher(A2aRequestHandler handler) {
        route(A2aMethods.MESSAGE_SEND, MessageSendParams.class, handler::onMessageSend);
        route(A2aMethods.TASKS_GET, TaskQueryParams.class, handler::onGetTask);
        route(A2aMethods.TASKS_LIST, TaskListParams.class, handler::onListTasks);
        route(A2aMethods.TASKS_CANCEL, TaskIdParams.class, handler::onCancelTask);
        route(A2aMethods.TASKS_FEEDBACK, TaskFeedbackParams.class, handler::onTaskFeedback);
        route(A2aMethods.PUSH_CONFIG_SET, TaskPushNotificationConfig.class, handler::onSetPushNotificationConfig);
        route(A2aMethods.PUSH_CONFIG_GET, TaskIdParams.class, handler::onGetPushNotificationConfig);
        route(A2aMethods.PUSH_CONFIG_LIST, TaskIdParams.class, handler::onListPushNotificationConfigs);
        route(A2aMethods.PUSH_CONFIG_DELETE, TaskIdParams.class, handler::onDeletePushNotificationConfig);
        route(A2aMethods.CONTEXTS_CREATE, ContextParams.class, handler::onCreateContext);
        route(A2aMethods.CONTEXTS_GET, ContextParams.class, handler::onGetContext);
        route(A2aMethods.CONTEXTS_LIST, ContextParams.class, handler::onListContexts);
        route(A2aMethods.CONTEXTS_CLEAR, ContextParams.class, handler::onClearContexts);
    }

    /**
     * @param params the request params, may be null or JSON null for methods without required params
     * @return the result object, ready to be serialized into the response
     * @throws JsonRpcException carrying the protocol error code
     */
    public Object dispatch(String method, JsonNode params) {
        Function<JsonNode, Object> route = routes.get(method);
        if (route == null) {
            throw JsonRpcException.methodNotFound(method);
        }
        try {
            return route.apply(params);
        } catch (RuntimeException e) {
            JsonRpcException error = JsonRpcException.from(e);
            if (error.getCode() == A2aErrorCodes.INTERNAL_ERROR_CODE) {
                log.error("Unexpected failure handling {}", method, e);
            }
            throw error;
        }
    }

    private <P> void route(String method, Class<P> paramsType, Function<P, Object> target) {
        routes.put(method, params -> target.apply(readParams(params, paramsType)));
    }

    private <P> P readParams(JsonNode params, Class<P> paramsType) {
        JsonNode node = params == null || params.isNull() ? objectMapper.createObjectNode() : params;
        try {
            return objectMapper.treeToValue(node, paramsType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw JsonRpcException.invalidParams("Invalid params: " + e.getMessage(), e);
        }
    }
}
