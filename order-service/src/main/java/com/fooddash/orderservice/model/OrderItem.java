package com.fooddash.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "order_items")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    private Order order;

    @Column(name = "menu_item_name", nullable = false, updatable = false)
    @ToString.Include
    private String menuItemName;

    @Column(name = "menu_item_description", updatable = false)
    private String menuItemDescription;

    // menu price when the order was placed
    @Column(name = "price_at_time", nullable = false, updatable = false)
    private BigDecimal priceAtTime;

    @Column(nullable = false, updatable = false)
    private Integer quantity;

    @Column(name = "line_total", nullable = false, updatable = false)
    private BigDecimal lineTotal;
}
