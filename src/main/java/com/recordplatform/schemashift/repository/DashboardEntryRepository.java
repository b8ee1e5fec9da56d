package com.recordplatform.schemashift.repository;

import com.recordplatform.schemashift.model.DashboardEntry;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DashboardEntryRepository extends MongoRepository<DashboardEntry, String> {

    List<DashboardEntry> findByOrganizationIdAndAcknowledgedFalseOrderByCreatedAtDesc(String organizationId);
}
