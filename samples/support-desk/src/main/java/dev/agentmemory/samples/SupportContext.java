/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package dev.agentmemory.samples;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-session state of a customer support conversation.
 */
public class SupportContext {

  /** Service level of the customer. */
  public enum CustomerTier {
    STANDARD, PREMIUM, VIP
  }

  @JsonProperty(value = "user_id", required = true)
  private String userId;

  @JsonProperty(value = "session_id", required = true)
  private String sessionId;

  @JsonProperty("customer_tier")
  private CustomerTier customerTier = CustomerTier.STANDARD;

  @JsonProperty("region")
  private String region;

  @JsonProperty("current_inquiry")
  private String currentInquiry;

  @JsonProperty("agent_notes")
  private List<String> agentNotes = new ArrayList<>();

  @JsonProperty("escalation_needed")
  private boolean escalationNeeded;

  @JsonProperty("created_at")
  private double createdAt;

  @JsonProperty("last_updated")
  private double lastUpdated;

  public SupportContext() {
  }

  public SupportContext(String sessionId, String userId, CustomerTier customerTier) {
    this.sessionId = sessionId;
    this.userId = userId;
    this.customerTier = customerTier;
    this.createdAt = now();
    this.lastUpdated = createdAt;
  }

  public String getUserId() {
    return userId;
  }

  public String getSessionId() {
    return sessionId;
  }

  public CustomerTier getCustomerTier() {
    return customerTier;
  }

  public String getRegion() {
    return region;
  }

  public String getCurrentInquiry() {
    return currentInquiry;
  }

  public List<String> getAgentNotes() {
    return agentNotes;
  }

  public boolean isEscalationNeeded() {
    return escalationNeeded;
  }

  public double getLastUpdated() {
    return lastUpdated;
  }

  public void updateRegion(String region) {
    this.region = region;
    touch();
  }

  public void updateInquiry(String inquiry) {
    this.currentInquiry = inquiry;
    touch();
  }

  public void addAgentNote(String note) {
    agentNotes.add("[" + Instant.now() + "] " + note);
    touch();
  }

  public void requestEscalation(String reason) {
    escalationNeeded = true;
    addAgentNote("ESCALATION REQUESTED: " + reason);
  }

  /**
   * Returns the fields shown in session overviews.
   *
   * @return the summary
   */
  public Map<String, Object> summary() {
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("user_id", userId);
    summary.put("session_id", sessionId);
    summary.put("customer_tier", customerTier);
    summary.put("current_inquiry", currentInquiry);
    summary.put("region", region);
    summary.put("agent_notes_count", agentNotes.size());
    summary.put("escalation_needed", escalationNeeded);
    summary.put("last_updated", Instant.ofEpochMilli((long) (lastUpdated * 1000)).toString());
    return summary;
  }

  private void touch() {
    lastUpdated = now();
  }

  private static double now() {
    return System.currentTimeMillis() / 1000.0;
  }
}
