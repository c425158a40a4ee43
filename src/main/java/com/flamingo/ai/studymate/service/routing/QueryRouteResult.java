package com.flamingo.ai.studymate.service.routing;

import com.flamingo.ai.studymate.domain.enums.QueryRoute;

/** Outcome of query sub-routing. */
public record QueryRouteResult(QueryRoute route, double confidence, String details) {}
