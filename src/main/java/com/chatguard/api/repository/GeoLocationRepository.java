package com.chatguard.api.repository;

import java.util.List;

import com.chatguard.api.data.GeoLocationRecord;

public interface GeoLocationRepository {
  public List<GeoLocationRecord> findLocations() throws KeywordSourceException;
}
