package com.example.charging.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "stations")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Station {

    @Id
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    private String address;

    @Column(name = "is_active")
    private boolean active;

    @Column(name = "is_open")
    private boolean open;

    private Integer maxQueueLength;

    private Integer averageSessionMinutes;
}
