package com.reportalert.engine.infrastructure.db.metric;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "kpis")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KpiEntity {

    @Id
    @Column(length = 40)
    private String id;

    @Column(nullable = false)
    private String name;
}
