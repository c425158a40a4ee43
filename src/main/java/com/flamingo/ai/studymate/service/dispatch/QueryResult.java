package com.flamingo.ai.studymate.service.dispatch;

import com.flamingo.ai.studymate.domain.enums.QueryRoute;
import java.util.Map;

/** Result of a query handler; {@code response} is always presentable to the user. */
public record QueryResult(
    DispatchStatus status, QueryRoute route, String response, Map<String, Object> data) {}
