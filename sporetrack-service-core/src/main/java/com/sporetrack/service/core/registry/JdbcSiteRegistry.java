package com.sporetrack.service.core.registry;

import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcSiteRegistry implements SiteRegistry {

    private final JdbcTemplate jdbc;

    public JdbcSiteRegistry(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<SiteRecord> findSite(UUID siteId) {
        if (siteId == null) {
            return Optional.empty();
        }
        return jdbc
                .query(
                        "SELECT site_id, tenant_id, program_id FROM sites WHERE site_id = ?",
                        (rs, rowNum) -> new SiteRecord(
                                (UUID) rs.getObject("site_id"),
                                (UUID) rs.getObject("tenant_id"),
                                (UUID) rs.getObject("program_id")),
                        siteId)
                .stream()
                .findFirst();
    }
}
