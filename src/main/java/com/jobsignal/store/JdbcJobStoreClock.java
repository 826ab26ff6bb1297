package com.jobsignal.store;

import org.springframework.jdbc.core.JdbcTemplate;

import java.time.OffsetDateTime;

public class JdbcJobStoreClock implements JobStoreClock {

    private final JdbcTemplate jdbcTemplate;

    public JdbcJobStoreClock(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public OffsetDateTime now() {
        OffsetDateTime now = jdbcTemplate.queryForObject("SELECT CURRENT_TIMESTAMP", OffsetDateTime.class);
        if (now == null) {
            throw new IllegalStateException("Job store returned no current timestamp");
        }
        return now;
    }
}
