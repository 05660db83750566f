package com.shop;

public class UserService {

    private final UserRepository repository;

    public UserService(UserRepository repository) {
        this.repository = repository;
    }

    /**
     * Retrieves a user by their unique identifier.
     *
     * @param id the user id
     * @return the user, or null when unknown
     */
    public User getUserById(String id) {
        return repository.findById(id);
    }

    public boolean isAdult(User user) {
        return user.getAge() >= 18 && user.isVerified();
    }

    public void register(User user) {
        validate(user);
        repository.save(user);
        validate(user);
    }

    void validate(User user) {
        if (user == null) {
            throw new IllegalArgumentException("user required");
        }
    }
}
