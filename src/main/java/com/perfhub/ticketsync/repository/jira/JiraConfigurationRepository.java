package com.perfhub.ticketsync.repository.jira;

import com.perfhub.ticketsync.model.jira.JiraConfiguration;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * Read access to status-bucket configurations. Writes belong to the admin screens.
 */
public interface JiraConfigurationRepository extends JpaRepository<JiraConfiguration, Long> {

    List<JiraConfiguration> findByActiveTrue();

    Optional<JiraConfiguration> findFirstByNameAndActiveTrue(String name);
}
