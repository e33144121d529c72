package com.mindcanvus.infrastructure.context;

import com.mindcanvus.domain.model.Actor;
import com.mindcanvus.domain.model.UserId;
import org.slf4j.MDC;

public final class RequestContext {

    private static final String USER_ID_KEY = "userId";
    private static final String REQUEST_ID_KEY = "requestId";

    private static final ThreadLocal<Actor> currentActor = new ThreadLocal<>();
    private static final ThreadLocal<String> currentRequestId = new ThreadLocal<>();

    private RequestContext() {}

    public static void set(Actor actor, String requestId) {
        currentActor.set(actor);
        currentRequestId.set(requestId);
        MDC.put(REQUEST_ID_KEY, requestId);
        if (!actor.isAnonymous()) {
            MDC.put(USER_ID_KEY, actor.userId().toString());
        }
    }

    /**
     * The authenticated caller, or {@link Actor#ANONYMOUS} on public routes without a token.
     */
    public static Actor getActor() {
        Actor actor = currentActor.get();
        return actor != null ? actor : Actor.ANONYMOUS;
    }

    public static UserId getUserId() {
        return getActor().userId();
    }

    public static String getRequestId() {
        return currentRequestId.get();
    }

    public static void clear() {
        currentActor.remove();
        currentRequestId.remove();
        MDC.remove(USER_ID_KEY);
        MDC.remove(REQUEST_ID_KEY);
    }
}
