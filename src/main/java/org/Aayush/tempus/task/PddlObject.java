package org.Aayush.tempus.task;

/**
 * Named constant with its declared type. Domain constants and problem objects share this type.
 */
public record PddlObject(String name, String type) {
}
