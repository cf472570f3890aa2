package com.owldoor.geocoder.service;

import com.owldoor.geocoder.model.GeocodeResult;
import com.owldoor.geocoder.service.provider.GeocodingProvider;
import com.owldoor.geocoder.service.provider.ProviderClient;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * In-process provider recording every query. By default "addr-N" resolves to (N / 1000, -N / 1000).
 */
class StubProviderClient implements ProviderClient {

    final List<String> queries = new ArrayList<>();
    private final Function<String, GeocodeResult> behaviour;

    StubProviderClient() {
        this(StubProviderClient::deterministic);
    }

    StubProviderClient(Function<String, GeocodeResult> behaviour) {
        this.behaviour = behaviour;
    }

    static GeocodeResult deterministic(String query) {
        int n = Integer.parseInt(query.substring(query.lastIndexOf('-') + 1));
        return GeocodeResult.success(n / 1000.0, -n / 1000.0, "Resolved " + query);
    }

    @Override
    public GeocodingProvider provider() {
        return GeocodingProvider.NOMINATIM;
    }

    @Override
    public GeocodeResult geocode(String query) {
        queries.add(query);
        return behaviour.apply(query);
    }
}
