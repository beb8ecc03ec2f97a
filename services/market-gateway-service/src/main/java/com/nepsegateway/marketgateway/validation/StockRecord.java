package com.nepsegateway.marketgateway.validation;

/** One entry of the symbol snapshot file. */
public record StockRecord(String name, String sector, String internalSector) {}
