package com.meteocache.repository;

public interface StorageTotalsView {
    Long getTotalForecasts();

    Long getTotalTextBytes();

    Long getTotalAudioBytes();
}
