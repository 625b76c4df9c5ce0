package com.fooddash.orderservice.model;

public enum ActorType {
    SYSTEM,  // Maintenance sweeps
    USER     // Customer, vendor, driver or admin acting through the API
}
