package com.cred.freestyle.erp.repository;

import com.cred.freestyle.erp.domain.model.RestoreJob;
import com.cred.freestyle.erp.domain.model.RestoreJob.RestoreStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for RestoreJob entity.
 *
 * @author ERP Platform Team
 */
@Repository
public interface RestoreJobRepository extends JpaRepository<RestoreJob, String> {

    /**
     * Count jobs that have not reached a terminal state.
     *
     * @param statuses Non-terminal statuses (PENDING, RUNNING)
     * @return Number of such jobs
     */
    long countByStatusIn(Collection<RestoreStatus> statuses);

    /**
     * Jobs in any of the given statuses.
     */
    List<RestoreJob> findByStatusIn(Collection<RestoreStatus> statuses);

    /**
     * Most recently submitted job, if any.
     */
    Optional<RestoreJob> findFirstByOrderByCreatedAtDesc();
}
