package com.workledger.api.model.enums;

public enum PtoStatus {
    pending,
    approved,
    rejected
}
