package com.weatherledger.ingest.rows;

import com.weatherledger.core.model.Forecast;
import com.weatherledger.core.parse.UnitParser;
import com.weatherledger.core.parse.WindReading;

import java.time.Instant;
import java.util.List;

import static com.weatherledger.ingest.rows.ObservationRowMapper.boxed;

/**
 * Column layout of the hourly forecast table: hour, condition, temperature, feels-like, precip chance,
 * precip amount, cloud cover, dew point, humidity, wind, pressure.
 */
public final class ForecastRowMapper {
    static final int HOUR = 0;
    static final int CONDITION = 1;
    static final int TEMPERATURE = 2;
    static final int FEELS_LIKE = 3;
    static final int PRECIP_CHANCE = 4;
    static final int PRECIP_AMOUNT = 5;
    static final int CLOUD_COVER = 6;
    static final int DEW_POINT = 7;
    static final int HUMIDITY = 8;
    static final int WIND = 9;
    static final int PRESSURE = 10;

    private ForecastRowMapper() {
    }

    public static String hourText(List<String> row) {
        return Cells.at(row, HOUR);
    }

    public static Forecast map(List<String> row, String location, Instant forecastAt, Instant scrapedAt) {
        WindReading wind = UnitParser.wind(Cells.at(row, WIND));
        return new Forecast(
                location,
                forecastAt,
                scrapedAt,
                boxed(UnitParser.temperature(Cells.at(row, TEMPERATURE))),
                boxed(UnitParser.temperature(Cells.at(row, FEELS_LIKE))),
                boxed(UnitParser.temperature(Cells.at(row, DEW_POINT))),
                boxed(UnitParser.percentage(Cells.at(row, HUMIDITY))),
                wind.speedMph(),
                wind.direction(),
                boxed(UnitParser.inches(Cells.at(row, PRESSURE))),
                boxed(UnitParser.percentage(Cells.at(row, PRECIP_CHANCE))),
                boxed(UnitParser.inches(Cells.at(row, PRECIP_AMOUNT))),
                boxed(UnitParser.percentage(Cells.at(row, CLOUD_COVER))),
                UnitParser.text(Cells.at(row, CONDITION))
        );
    }
}
