package com.weatherledger.ingest.rows;

import com.weatherledger.core.model.Observation;
import com.weatherledger.core.parse.UnitParser;
import com.weatherledger.core.parse.WindReading;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Column layout of the daily history table: time, temperature, dew point, humidity, wind direction,
 * wind speed, wind gust, pressure, precipitation, condition.
 */
public final class ObservationRowMapper {
    static final int TIME = 0;
    static final int TEMPERATURE = 1;
    static final int DEW_POINT = 2;
    static final int HUMIDITY = 3;
    static final int WIND_DIRECTION = 4;
    static final int WIND_SPEED = 5;
    static final int PRESSURE = 7;
    static final int PRECIPITATION = 8;
    static final int CONDITION = 9;

    private ObservationRowMapper() {
    }

    public static String timeText(List<String> row) {
        return Cells.at(row, TIME);
    }

    public static Observation map(List<String> row, String location, Instant observedAt, Instant scrapedAt) {
        String combinedWind = (Cells.at(row, WIND_SPEED).trim() + " " + Cells.at(row, WIND_DIRECTION).trim()).trim();
        WindReading wind = UnitParser.wind(combinedWind);
        return new Observation(
                location,
                observedAt,
                scrapedAt,
                boxed(UnitParser.temperature(Cells.at(row, TEMPERATURE))),
                boxed(UnitParser.temperature(Cells.at(row, DEW_POINT))),
                boxed(UnitParser.percentage(Cells.at(row, HUMIDITY))),
                wind.speedMph(),
                wind.direction(),
                wind.gustMph(),
                boxed(UnitParser.inches(Cells.at(row, PRESSURE))),
                boxed(UnitParser.inches(Cells.at(row, PRECIPITATION))),
                UnitParser.text(Cells.at(row, CONDITION)),
                null,
                null,
                null,
                null
        );
    }

    static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    static Integer boxed(OptionalInt value) {
        return value.isPresent() ? value.getAsInt() : null;
    }
}
