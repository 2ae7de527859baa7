package com.quantdesk.backend.repository;

import com.quantdesk.backend.model.Indicator;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface IndicatorRepository extends JpaRepository<Indicator, String> {

    List<Indicator> findAllByOrderByCatalogOrderAsc();

    Optional<Indicator> findByNameIgnoreCase(String name);

    Optional<Indicator> findTopByOrderByCatalogOrderDesc();
}
