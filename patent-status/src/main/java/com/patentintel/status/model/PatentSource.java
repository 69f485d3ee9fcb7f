package com.patentintel.status.model;

public enum PatentSource {
    EPO,
    USPTO
}
