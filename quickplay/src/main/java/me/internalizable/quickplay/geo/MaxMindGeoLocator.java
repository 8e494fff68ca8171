package me.internalizable.quickplay.geo;

import com.maxmind.geoip2.DatabaseReader;
import com.maxmind.geoip2.exception.GeoIp2Exception;
import com.maxmind.geoip2.model.AsnResponse;
import com.maxmind.geoip2.model.CityResponse;
import me.internalizable.quickplay.api.capability.GeoLocation;
import me.internalizable.quickplay.api.capability.GeoLocator;
import me.internalizable.quickplay.api.capability.GeoLookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link GeoLocator} over local MaxMind City and ASN databases.
 *
 * <p>The ASN database is optional; without it {@link #networkOf} always
 * returns null. Keeping the databases current is up to the operator.</p>
 */
public final class MaxMindGeoLocator implements GeoLocator, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MaxMindGeoLocator.class);

    private final DatabaseReader cityReader;
    private final DatabaseReader asnReader;

    private MaxMindGeoLocator(DatabaseReader cityReader, @Nullable DatabaseReader asnReader) {
        this.cityReader = cityReader;
        this.asnReader = asnReader;
    }

    /**
     * Open the databases.
     *
     * @param cityDatabase path of the City database
     * @param asnDatabase path of the ASN database, or null
     * @return the locator
     * @throws IOException if a database cannot be opened
     */
    @Nonnull
    public static MaxMindGeoLocator open(@Nonnull Path cityDatabase, @Nullable Path asnDatabase) throws IOException {
        Objects.requireNonNull(cityDatabase, "cityDatabase");
        DatabaseReader city = new DatabaseReader.Builder(cityDatabase.toFile()).build();

        DatabaseReader asn = null;
        if (asnDatabase != null && Files.exists(asnDatabase)) {
            asn = new DatabaseReader.Builder(asnDatabase.toFile()).build();
        } else {
            LOGGER.warn("ASN database {} not found, anycast detection disabled", asnDatabase);
        }

        LOGGER.info("Opened geolocation database {}", cityDatabase);
        return new MaxMindGeoLocator(city, asn);
    }

    @Override
    @Nonnull
    public GeoLocation locate(@Nonnull String address) throws GeoLookupException {
        try {
            CityResponse city = cityReader.city(InetAddress.getByName(address));
            Double latitude = city.getLocation().getLatitude();
            Double longitude = city.getLocation().getLongitude();
            if (latitude == null || longitude == null) {
                throw new GeoLookupException("No coordinates for " + address);
            }
            return new GeoLocation(city.getCountry().getIsoCode(), city.getContinent().getCode(), latitude, longitude);
        } catch (IOException | GeoIp2Exception e) {
            throw new GeoLookupException("Failed to locate " + address, e);
        }
    }

    @Override
    @Nullable
    public String networkOf(@Nonnull String address) {
        if (asnReader == null) {
            return null;
        }
        try {
            AsnResponse asn = asnReader.asn(InetAddress.getByName(address));
            return asn.getNetwork() != null ? asn.getNetwork().toString() : null;
        } catch (UnknownHostException e) {
            LOGGER.debug("Invalid address {}", address);
            return null;
        } catch (IOException | GeoIp2Exception e) {
            LOGGER.debug("No network block for {}: {}", address, e.getMessage());
            return null;
        }
    }

    @Override
    public void close() throws IOException {
        cityReader.close();
        if (asnReader != null) {
            asnReader.close();
        }
    }
}
