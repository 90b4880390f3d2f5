package com.bank_sync_engine.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("categories")
public class Category {

    @Id
    private UUID id;

    // null for system categories shared by every company
    @Column("company_id")
    private UUID companyId;

    @Column("name")
    private String name;

    @Column("slug")
    private String slug;

    @Column("category_type")
    private CategoryType categoryType;

    // JSON array of hint words for the classifier, e.g. ["aluguel","locacao"]
    @Column("keywords")
    private String keywords;

    @Column("accuracy_rate")
    private Double accuracyRate;

    @Column("is_system")
    private Boolean system;

    @Column("is_active")
    private Boolean active;
}
