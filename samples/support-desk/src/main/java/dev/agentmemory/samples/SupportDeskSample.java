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

import java.util.List;
import java.util.Locale;
import java.util.Map;

import dev.agentmemory.AgentSession;
import dev.agentmemory.SessionDeletion;
import dev.agentmemory.UnifiedSessionManager;
import dev.agentmemory.core.JsonUtils;
import dev.agentmemory.core.store.KeyValueStore;
import dev.agentmemory.plugins.redis.RedisKeyValueStore;
import dev.agentmemory.plugins.redis.RedisStoreOptions;
import dev.agentmemory.session.ConversationLog;

/**
 * Support desk walkthrough backed by Redis.
 *
 * <p>
 * This sample demonstrates:
 * <ul>
 * <li>Keeping conversation history per session</li>
 * <li>Updating a typed context under the session lock</li>
 * <li>Retracting the last turn</li>
 * <li>Session overviews, listing and deletion</li>
 * </ul>
 *
 * <p>
 * To run:
 * <ol>
 * <li>Start Redis, or set AGENT_MEMORY_REDIS_URL</li>
 * <li>Run: mvn exec:java -pl samples/support-desk</li>
 * </ol>
 */
public class SupportDeskSample {

  private final UnifiedSessionManager<SupportContext> memory;

  public SupportDeskSample(KeyValueStore store) {
    this.memory = UnifiedSessionManager.builder(SupportContext.class).store(store)
        .contextFactory((sessionId, userId) -> new SupportContext(sessionId, userId,
            SupportContext.CustomerTier.STANDARD))
        .summarizer(SupportContext::summary).build();
  }

  /**
   * Handles one customer message: records the inquiry under the session lock
   * and appends both sides of the exchange to the conversation log.
   *
   * @param sessionId
   *            the session id
   * @param userId
   *            the customer id
   * @param message
   *            the customer's message
   * @return the reply
   */
  public String handleMessage(String sessionId, String userId, String message) {
    String reply = memory.withContext(sessionId, userId, context -> {
      context.updateInquiry(message);
      String lower = message.toLowerCase(Locale.ROOT);
      if (lower.contains("refund") || lower.contains("broken")) {
        context.requestEscalation("customer reported: " + message);
        return "I'm sorry about that. A specialist will follow up shortly.";
      }
      context.addAgentNote("answered inquiry");
      return "Thanks for reaching out! How else can I help?";
    });

    memory.conversationLog(sessionId).append(
        List.of(Map.of("role", "user", "content", message), Map.of("role", "assistant", "content", reply)));
    return reply;
  }

  /**
   * Runs the scripted walkthrough.
   */
  public void run() {
    System.out.println("=== Support desk ===");
    System.out.println("Agent: " + handleMessage("order-1001", "alice", "Where is my parcel?"));
    System.out.println("Agent: " + handleMessage("order-1001", "alice", "It arrived broken"));

    AgentSession<SupportContext> session = memory.session("order-1001", "alice");
    session.patchContext(Map.of("region", "eu"));
    System.out.println("Region set to: " + session.getContext().getRegion());

    ConversationLog log = session.getConversationLog();
    System.out.println("Last two turns: " + log.read(2));
    log.popLast().ifPresent(turn -> System.out.println("Retracted: " + turn));
    System.out.println("Log size after retraction: " + log.size());

    handleMessage("order-1002", "bob", "Can I change my delivery address?");

    System.out.println("Overview: " + JsonUtils.toJson(session.overview()));
    System.out.println("Sessions: " + JsonUtils.toJson(memory.listAllSessions()));
    System.out.println("Cleanup: " + JsonUtils.toJson(memory.cleanupExpired()));

    for (String sessionId : List.of("order-1001", "order-1002")) {
      SessionDeletion deletion = memory.deleteEverything(sessionId);
      System.out.println("Deleted " + sessionId + ": " + deletion);
    }
  }

  public UnifiedSessionManager<SupportContext> getMemory() {
    return memory;
  }

  public static void main(String[] args) {
    KeyValueStore store = new RedisKeyValueStore(RedisStoreOptions.builder().build());
    SupportDeskSample sample = new SupportDeskSample(store);
    try (UnifiedSessionManager<SupportContext> memory = sample.getMemory()) {
      sample.run();
    }
  }
}
