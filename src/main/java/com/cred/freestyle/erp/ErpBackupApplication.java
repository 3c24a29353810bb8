package com.cred.freestyle.erp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the ERP backup service.
 *
 * System Overview:
 * - Creates point-in-time ZIP archives of the ERP's live data directory (and optionally its logs)
 * - Verifies archive integrity without extracting to disk
 * - Restores an archive in the background, staging it fully before swapping it in
 * - Role-gated REST API (admin / manager) in front of every operation
 * - Cron-driven scheduled backups with count-based retention
 *
 * Architecture:
 * - API Layer: REST controller with validation and role checks
 * - Service Layer: backup lifecycle and restore job tracking
 * - Data Access Layer: JPA repository for restore jobs
 * - Infrastructure Layer: archive codec, data store lock, Micrometer metrics, scheduler
 *
 * @author ERP Platform Team
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableJpaRepositories
@EnableTransactionManagement
@EnableScheduling
public class ErpBackupApplication {

    public static void main(String[] args) {
        SpringApplication.run(ErpBackupApplication.class, args);
    }
}
