package com.paideia.backend.modules.course.domain;

public enum EnrollmentStatus {
    ACTIVE,
    INACTIVE,
    COMPLETED,
    DROPPED
}
