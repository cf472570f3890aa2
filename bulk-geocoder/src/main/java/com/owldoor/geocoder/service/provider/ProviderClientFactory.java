package com.owldoor.geocoder.service.provider;

/**
 * Builds a ready-to-use client for a provider id, validating its configuration first.
 */
@FunctionalInterface
public interface ProviderClientFactory {

    /**
     * @throws com.owldoor.geocoder.exception.ConfigurationException for an unknown provider id or
     *                                                               a missing required API key
     */
    ProviderClient create(String providerId, String apiKey);
}
