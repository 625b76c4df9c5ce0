package com.fooddash.orderservice.security;

// Client roles issued in the resource_access claim
public enum Role {
    CUSTOMER,
    VENDOR,
    DRIVER,
    ADMIN
}
