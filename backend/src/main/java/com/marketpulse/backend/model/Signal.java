package com.marketpulse.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "signals", uniqueConstraints = @UniqueConstraint(name = "uq_signals_asset_ts", columnNames = {"asset", "ts"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Signal {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String asset;

    @Column(name = "ts", nullable = false)
    private Instant ts;

    @Column(nullable = false)
    private double ema15;

    @Column(nullable = false)
    private int mentions;

    @Column(name = "baseline_7d", nullable = false)
    private double baseline7d;

    @Column(name = "mentions_z", nullable = false)
    private double mentionsZ;

    @Column(nullable = false)
    private double alpha;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SignalAction action;

    @Column(name = "price_close")
    private Double priceClose;

    private Double rsi14;

    private Double macd;

    @Column(name = "macd_signal")
    private Double macdSignal;

    @Column(name = "atr_pct")
    private Double atrPct;

    @Column(name = "price_bias")
    private Double priceBias;

    @Column(name = "trend_bias", length = 8)
    private String trendBias;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
