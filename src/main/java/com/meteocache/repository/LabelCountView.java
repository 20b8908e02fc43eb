package com.meteocache.repository;

public interface LabelCountView {
    String getLabel();

    Long getOccurrences();
}
