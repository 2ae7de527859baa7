package com.quantdesk.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "datasets")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Dataset {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(name = "column_names", columnDefinition = "TEXT")
    private List<String> columnNames = new ArrayList<>();

    // rows serialized as a JSON array of column -> value objects
    @Column(name = "rows_payload", columnDefinition = "TEXT")
    private String rowsPayload;

    @Column(name = "row_count", nullable = false)
    private int rowCount;

    // optimistic lock over the whole rows payload
    @Version
    private Long version;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
