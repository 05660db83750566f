package com.shop;

/**
 * A registered shop customer.
 */
public class User {

    private final String id;
    private final int age;
    private final boolean verified;

    public User(String id, int age, boolean verified) {
        this.id = id;
        this.age = age;
        this.verified = verified;
    }

    public String getId() {
        return id;
    }

    public int getAge() {
        return age;
    }

    public boolean isVerified() {
        return verified;
    }
}
