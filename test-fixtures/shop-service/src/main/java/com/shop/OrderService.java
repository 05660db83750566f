package com.shop;

import java.util.concurrent.CompletableFuture;

public class OrderService {

    private final UserService users;

    public OrderService(UserService users) {
        this.users = users;
    }

    public CompletableFuture<Order> placeOrderAsync(String userId, long amountCents) {
        return CompletableFuture.supplyAsync(() -> placeOrder(userId, amountCents));
    }

    public Order placeOrder(String userId, long amountCents) {
        User user = users.getUserById(userId);
        if (user == null || !users.isAdult(user)) {
            throw new IllegalStateException("customer cannot order: " + userId);
        }
        return new Order(userId + "-" + amountCents, userId, amountCents);
    }

    static class PriorityOrderService extends OrderService {

        PriorityOrderService(UserService users) {
            super(users);
        }
    }
}
