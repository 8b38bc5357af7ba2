package com.acme.learnlite.user;

import com.acme.learnlite.auth.CredentialService;
import com.acme.learnlite.common.ConflictException;
import com.acme.learnlite.common.ForbiddenException;
import com.acme.learnlite.common.NotFoundException;
import com.acme.learnlite.common.PageInfo;
import com.acme.learnlite.common.Pagination;
import com.acme.learnlite.common.ValidationException;
import com.acme.learnlite.db.QueryResult;
import com.acme.learnlite.db.Rows;
import com.acme.learnlite.db.SqlClient;
import com.acme.learnlite.security.AuthPrincipal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class UserService {
    private static final Logger log = LoggerFactory.getLogger(UserService.class);
    static final String PROFILE_COLUMNS = "id, email, name, role, created_at";

    private final SqlClient sql;
    private final CredentialService credentials;

    public UserService(SqlClient sql, CredentialService credentials) {
        this.sql = sql;
        this.credentials = credentials;
    }

    public UserDtos.UserPage listUsers(Pagination pagination) {
        QueryResult count = sql.query("SELECT COUNT(*) AS total FROM users", List.of());
        long total = count.firstRow().map(row -> Rows.getLongOrZero(row, "total")).orElse(0L);
        QueryResult rows = sql.query(
                "SELECT " + PROFILE_COLUMNS + " FROM users ORDER BY created_at DESC LIMIT ? OFFSET ?",
                List.of(pagination.limit(), pagination.offset()));
        List<UserProfile> users = rows.rows().stream().map(UserProfile::fromRow).toList();
        return new UserDtos.UserPage(users, PageInfo.of(pagination, total));
    }

    public Optional<UserProfile> findProfile(long id) {
        return sql.query("SELECT " + PROFILE_COLUMNS + " FROM users WHERE id = ?", List.of(id))
                .firstRow()
                .map(UserProfile::fromRow);
    }

    public UserProfile getUser(long id, AuthPrincipal actor) {
        requireSelfOrAdmin(id, actor);
        return findProfile(id).orElseThrow(NotFoundException::user);
    }

    public UserProfile createUser(UserDtos.CreateUserCommand command) {
        if (emailTaken(command.email(), null)) {
            throw ConflictException.emailExists();
        }
        try {
            QueryResult inserted = sql.query(
                    "INSERT INTO users (email, password_hash, name, role) VALUES (?, ?, ?, ?) RETURNING " + PROFILE_COLUMNS,
                    List.of(command.email(), credentials.hashPassword(command.password()), command.name(), command.role().value()));
            UserProfile profile = inserted.firstRow().map(UserProfile::fromRow)
                    .orElseThrow(() -> new IllegalStateException("insert returned no row"));
            log.info("user created id={} role={}", profile.id(), profile.role().value());
            return profile;
        } catch (DuplicateKeyException e) {
            throw ConflictException.emailExists();
        }
    }

    public UserProfile updateUser(long id, UserDtos.UpdateUserCommand command, AuthPrincipal actor) {
        requireSelfOrAdmin(id, actor);
        if (command.role() != null && !actor.isAdmin()) {
            log.warn("role change denied actor={} target={}", actor.userId(), id);
            throw new ForbiddenException("Only admins can change roles");
        }
        if (command.isEmpty()) {
            return findProfile(id).orElseThrow(NotFoundException::user);
        }
        if (command.email() != null && emailTaken(command.email(), id)) {
            throw ConflictException.emailExists();
        }

        List<String> sets = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        if (command.email() != null) {
            sets.add("email = ?");
            params.add(command.email());
        }
        if (command.name() != null) {
            sets.add("name = ?");
            params.add(command.name());
        }
        if (command.password() != null) {
            sets.add("password_hash = ?");
            params.add(credentials.hashPassword(command.password()));
        }
        if (command.role() != null) {
            sets.add("role = ?");
            params.add(command.role().value());
        }
        sets.add("updated_at = NOW()");
        params.add(id);

        try {
            return sql.query("UPDATE users SET " + String.join(", ", sets) + " WHERE id = ? RETURNING " + PROFILE_COLUMNS, params)
                    .firstRow()
                    .map(UserProfile::fromRow)
                    .orElseThrow(NotFoundException::user);
        } catch (DuplicateKeyException e) {
            throw ConflictException.emailExists();
        }
    }

    public void deleteUser(long id, AuthPrincipal actor) {
        if (!actor.isAdmin()) {
            throw new ForbiddenException("Only admins can delete users");
        }
        if (actor.userId() == id) {
            throw new ValidationException("Cannot delete your own account");
        }
        Integer deleted = sql.query("DELETE FROM users WHERE id = ?", List.of(id)).rowCount();
        if (deleted == null || deleted < 1) {
            throw NotFoundException.user();
        }
        log.info("user deleted id={} by={}", id, actor.userId());
    }

    private boolean emailTaken(String email, Long exceptId) {
        return sql.query("SELECT id FROM users WHERE email = ?", List.of(email)).rows().stream()
                .anyMatch(row -> exceptId == null || !exceptId.equals(Rows.getLong(row, "id")));
    }

    private static void requireSelfOrAdmin(long id, AuthPrincipal actor) {
        if (!actor.isAdmin() && actor.userId() != id) {
            throw new ForbiddenException("Access denied");
        }
    }
}
