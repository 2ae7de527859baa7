package com.quantdesk.backend.repository;

import com.quantdesk.backend.model.Dataset;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface DatasetRepository extends JpaRepository<Dataset, Long> {

    Optional<Dataset> findByName(String name);

    List<Dataset> findAllByOrderByNameAsc();
}
