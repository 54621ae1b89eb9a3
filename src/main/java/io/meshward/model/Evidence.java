package io.meshward.model;

import java.util.Map;

/**
 * One observation supporting a critical event. New kinds implement this
 * interface; {@link #attributes()} is what ends up in audit rows and stats.
 */
public interface Evidence {

    String kind();

    Map<String, Object> attributes();
}
