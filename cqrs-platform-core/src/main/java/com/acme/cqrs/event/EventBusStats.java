package com.acme.cqrs.event;

public record EventBusStats(
    int handlerCount,
    int subscriptionCount,
    int middlewareCount,
    long published,
    long succeeded,
    long failed,
    long retried) {}
