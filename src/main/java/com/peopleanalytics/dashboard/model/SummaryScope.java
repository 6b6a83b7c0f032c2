package com.peopleanalytics.dashboard.model;

public enum SummaryScope {
    EMPLOYEE,
    DEPARTMENT,
    FIRM
}
