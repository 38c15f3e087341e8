package com.ednataxa.api.config;

public enum DatasetFormat {
    TSV,
    CSV,
    JSON
}
