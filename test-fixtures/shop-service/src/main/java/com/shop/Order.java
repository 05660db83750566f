package com.shop;

public record Order(String id, String userId, long amountCents) {
}
