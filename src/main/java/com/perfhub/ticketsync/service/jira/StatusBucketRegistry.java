package com.perfhub.ticketsync.service.jira;

import com.perfhub.ticketsync.model.jira.BucketConfig;
import com.perfhub.ticketsync.model.jira.BucketConfigSnapshot;
import com.perfhub.ticketsync.model.jira.JiraConfiguration;
import com.perfhub.ticketsync.repository.jira.JiraConfigurationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Supplies status-bucket definitions. A sync run calls {@link #loadSnapshot()} once and
 * resolves every ticket against that snapshot, so edits made mid-run do not mix.
 */
@Service
public class StatusBucketRegistry {

    private static final Logger log = LoggerFactory.getLogger(StatusBucketRegistry.class);

    private final JiraConfigurationRepository repository;

    public StatusBucketRegistry(JiraConfigurationRepository repository) {
        this.repository = repository;
    }

    @Transactional(readOnly = true)
    public BucketConfigSnapshot loadSnapshot() {
        List<BucketConfig> configs = new ArrayList<>();
        for (JiraConfiguration configuration : repository.findByActiveTrue()) {
            configs.add(configuration.toBucketConfig());
        }
        log.info("Loaded {} active status-bucket configuration(s)", configs.size());
        return new BucketConfigSnapshot(configs);
    }

    @Transactional(readOnly = true)
    public Optional<JiraConfiguration> findActiveConfiguration(String name) {
        return repository.findFirstByNameAndActiveTrue(name);
    }
}
