package com.acme.learnlite.admin;

import com.acme.learnlite.auth.CredentialService;
import com.acme.learnlite.common.Role;
import com.acme.learnlite.db.Rows;
import com.acme.learnlite.db.SqlClient;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Component
public class AdminBootstrap {
    private static final Logger log = LoggerFactory.getLogger(AdminBootstrap.class);

    private final SqlClient sql;
    private final CredentialService credentials;

    @Value("${app.admin.seed-email:admin@learnlite.local}")
    private String adminEmail;

    @Value("${app.admin.seed-password:ChangeMe123!}")
    private String adminPassword;

    @Value("${app.admin.seed-enabled:true}")
    private boolean seedEnabled;

    @Value("${app.admin.seed-name:Administrator}")
    private String adminName;

    public AdminBootstrap(SqlClient sql, CredentialService credentials) {
        this.sql = sql;
        this.credentials = credentials;
    }

    @PostConstruct
    public void seedAdmin() {
        if (!seedEnabled) return;
        String email = adminEmail.trim().toLowerCase(Locale.ROOT);
        String hash = credentials.hashPassword(adminPassword);
        Optional<Map<String, Object>> existing = sql.query("SELECT id, role FROM users WHERE email = ?", List.of(email)).firstRow();
        if (existing.isPresent()) {
            long id = Rows.getLongOrZero(existing.get(), "id");
            sql.query("UPDATE users SET role = ?, password_hash = ?, updated_at = NOW() WHERE id = ?", List.of(Role.ADMIN.value(), hash, id));
            log.info("admin account refreshed id={}", id);
            return;
        }
        sql.query("INSERT INTO users (email, password_hash, name, role) VALUES (?, ?, ?, ?)", List.of(email, hash, adminName, Role.ADMIN.value()));
        log.info("admin account seeded email={}", email);
    }
}
