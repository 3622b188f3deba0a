package com.flamingo.ai.timelineqa.service.router;

import com.flamingo.ai.timelineqa.domain.enums.RouterState;

/** One edge taken through the router state machine. */
public record StateTransition(RouterState from, RouterState to, String reason) {}
