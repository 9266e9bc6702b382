package com.workledger.api.model.enums;

public enum Activity {
    WORK,    // Reported by the worker for a regular working day
    HOLIDAY, // Date is on the company holiday calendar
    PTO      // Date falls inside an approved leave request
}
