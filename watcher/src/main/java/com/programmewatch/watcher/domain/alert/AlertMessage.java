package com.programmewatch.watcher.domain.alert;

public record AlertMessage(String subject, String body) {}
