package com.datapulse.etl.extract;

/**
 * One entry of the catalogue side menu.
 */
public record CatalogCategory(String name, String url) {
}
