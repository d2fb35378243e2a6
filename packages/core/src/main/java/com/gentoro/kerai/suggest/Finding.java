package com.gentoro.kerai.suggest;

/** A rule firing on one node. */
public record Finding(String ruleId, String targetId, String message) {}
