package io.a2a.extras.taskengine.handler;

/**
 * JSON-RPC method names served by {@link A2aMethodDispatcher}.
 */
public final class A2aMethods {

    public static final String MESSAGE_SEND = "message/send";
    public static final String TASKS_GET = "tasks/get";
    public static final String TASKS_LIST = "tasks/list";
    public static final String TASKS_CANCEL = "tasks/cancel";
    public static final String TASKS_FEEDBACK = "tasks/feedback";
    public static final String PUSH_CONFIG_SET = "tasks/pushNotification/set";
    public static final String PUSH_CONFIG_GET = "tasks/pushNotification/get";
    public static final String PUSH_CONFIG_LIST = "tasks/pushNotification/list";
    public static final String PUSH_CONFIG_DELETE = "tasks/pushNotification/delete";
    public static final String CONTEXTS_CREATE = "contexts/create";
    public static final String CONTEXTS_GET = "contexts/get";
    public static final String CONTEXTS_LIST = "contexts/list";
    public static final String CONTEXTS_CLEAR = "contexts/clear";

    private A2aMethods() {
    }
}
