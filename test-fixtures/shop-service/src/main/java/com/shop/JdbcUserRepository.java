package com.shop;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

public class JdbcUserRepository implements UserRepository {

    private final Connection connection;

    public JdbcUserRepository(Connection connection) {
        this.connection = connection;
    }

    @Override
    public User findById(String id) {
        try (PreparedStatement ps = connection.prepareStatement("SELECT id, age, verified FROM users WHERE id = ?")) {
            ps.setString(1, id);
            ResultSet rs = ps.executeQuery();
            return rs.next() ? new User(rs.getString(1), rs.getInt(2), rs.getBoolean(3)) : null;
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public void save(User user) {
        try (PreparedStatement ps = connection.prepareStatement("INSERT INTO users VALUES (?, ?, ?)")) {
            ps.setString(1, user.getId());
            ps.setInt(2, user.getAge());
            ps.setBoolean(3, user.isVerified());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
    }
}
