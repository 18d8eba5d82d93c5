package com.trenddigest.data;

import com.trenddigest.config.Config;
import com.trenddigest.data.http.HttpClientEx;
import com.trenddigest.model.Topic;
import com.trenddigest.model.TopicBatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Weibo hot-search board via TianAPI.
 * Envelope: {@code {code, msg, result: {list: [{hottag, hotword, hotwordnum}]}}}; only {@code code == 200} is accepted.
 */
public final class WeiboHotSearchClient implements TopicSource {
    private static final Logger LOG = LogManager.getLogger(WeiboHotSearchClient.class);
    static final int PROVIDER_OK = 200;

    private final HttpClientEx http;
    private final String baseUrl;
    private final String apiKey;
    private final int timeoutSec;

    public WeiboHotSearchClient(Config config, HttpClientEx http) {
        this(
                http,
                config.getString("topic.base_url"),
                config.requireString("topic.api_key"),
                Math.max(1, config.getInt("topic.timeout_sec", 10))
        );
    }

    public WeiboHotSearchClient(HttpClientEx http, String baseUrl, String apiKey, int timeoutSec) {
        this.http = http;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.timeoutSec = timeoutSec;
    }

    @Override
    public TopicBatch fetch(int limit) throws TopicFetchException {
        int safeLimit = Math.max(1, limit);
        LOG.info("Fetching hot-search board, limit={}", safeLimit);
        String body;
        try {
            body = http.getText(baseUrl, Map.of("key", apiKey), timeoutSec);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TopicFetchException("hot-search request interrupted", e);
        } catch (IOException | RuntimeException e) {
            throw new TopicFetchException("hot-search request failed: " + describe(e), e);
        }

        List<Topic> topics = parse(body);
        TopicBatch batch = new TopicBatch(topics).truncate(safeLimit);
        LOG.info("Fetched {} topics (provider returned {})", batch.size(), topics.size());
        return batch;
    }

    static List<Topic> parse(String body) throws TopicFetchException {
        if (body == null || body.trim().isEmpty()) {
            throw new TopicFetchException("hot-search provider returned an empty body");
        }
        JSONObject root;
        try {
            root = new JSONObject(body.trim());
        } catch (JSONException e) {
            throw new TopicFetchException("hot-search provider returned malformed JSON: " + e.getMessage(), e);
        }

        if (!root.has("code")) {
            throw new TopicFetchException("hot-search response has no status code");
        }
        int code = root.optInt("code", -1);
        if (code != PROVIDER_OK) {
            String msg = root.optString("msg", "");
            throw new TopicFetchException("hot-search provider rejected request: code=" + code
                    + " msg=" + (msg.isBlank() ? "unknown error" : msg));
        }

        JSONObject result = root.optJSONObject("result");
        JSONArray list = result == null ? null : result.optJSONArray("list");
        if (list == null) {
            throw new TopicFetchException("hot-search response has no result.list");
        }

        List<Topic> out = new ArrayList<>(list.length());
        for (int i = 0; i < list.length(); i++) {
            JSONObject item = list.optJSONObject(i);
            if (item == null) {
                continue;
            }
            Object weight = item.opt("hotwordnum");
            out.add(new Topic(
                    item.optString("hottag", ""),
                    item.optString("hotword", ""),
                    weight == null || JSONObject.NULL.equals(weight) ? "0" : String.valueOf(weight)
            ));
        }
        return out;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
