package com.example.Botlyne.repository;

import com.example.Botlyne.model.KnowledgeBase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface KnowledgeBaseRepository extends JpaRepository<KnowledgeBase, String> {

    boolean existsByIdAndTenantId(String id, String tenantId);
}
