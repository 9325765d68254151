package com.budgetme.goals.entities;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "families")
@Data
public class Family {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "family_name", nullable = false)
    private String familyName;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
