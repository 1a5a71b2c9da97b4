package com.paideia.backend.modules.user.domain;

public enum GlobalRole {
    ADMIN,
    CONTENT_MANAGER,
    ANALYTICS_VIEWER,
    INSTRUCTOR,
    STUDENT;

    public boolean isSystemAdmin() {
        return this == ADMIN;
    }
}
