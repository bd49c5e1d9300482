package com.foo.sheets.model;

public record GroupMetric(String group, double metric) {}
