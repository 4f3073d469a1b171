package com.astro.calpipe.model;

public enum ReductionStatus { RAW, REDUCED }
