package com.verso.registry.domain.device;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.verso.registry.domain.Entity;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Number of devices last seen on one UTC date, keyed by that date.
 */
public class DeviceCount extends Entity {
    private int total;
    private Map<String, Integer> userAgents = new TreeMap<>();

    public static DeviceCount of(String date, List<Device> devices) {
        DeviceCount count = new DeviceCount();
        count.setDate(date);
        for (Device device : devices) {
            count.increment(device);
        }
        return count;
    }

    public void increment(Device device) {
        total++;
        if (device.getUserAgent() != null && !device.getUserAgent().isBlank()) {
            userAgents.merge(device.getUserAgent(), 1, Integer::sum);
        }
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (!isDate(getId())) {
            problems.add("Date is missing or invalid");
        }
        if (getCreatedAt() == null) {
            problems.add("CreatedAt is missing");
        }
        return problems;
    }

    public static boolean isDate(String value) {
        if (value == null) {
            return false;
        }
        try {
            return LocalDate.parse(value).toString().equals(value);
        } catch (DateTimeParseException ex) {
            return false;
        }
    }

    @JsonIgnore
    @Override
    public String getId() {
        return super.getId();
    }

    public String getDate() {
        return getId();
    }

    public void setDate(String date) {
        setId(date);
    }

    public int getTotal() {
        return total;
    }

    public void setTotal(int total) {
        this.total = total;
    }

    public Map<String, Integer> getUserAgents() {
        return userAgents;
    }

    public void setUserAgents(Map<String, Integer> userAgents) {
        this.userAgents = userAgents == null ? new TreeMap<>() : new TreeMap<>(userAgents);
    }
}
