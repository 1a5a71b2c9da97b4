package com.paideia.backend.modules.course.domain;

public enum EnrollmentRole {
    STUDENT("student"),
    TEACHER("teacher"),
    TA("ta"),
    MANAGER("manager");

    private final String value;

    EnrollmentRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
