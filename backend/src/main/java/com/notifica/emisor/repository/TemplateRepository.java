package com.notifica.emisor.repository;

import com.notifica.emisor.model.Template;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface TemplateRepository extends JpaRepository<Template, Long> {
    Optional<Template> findByIdAndDeletedFalse(Long id);
    List<Template> findByProjectIdAndDeletedFalseOrderByNameAsc(Long projectId);
}
