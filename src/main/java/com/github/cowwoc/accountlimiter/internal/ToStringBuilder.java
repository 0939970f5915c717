package com.github.cowwoc.accountlimiter.internal;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.StringJoiner;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Formats the return value of {@code toString()} methods.
 * <p>
 * Properties are listed one per line, with their names aligned:
 * <pre>
 * TokenBucket
 * {
 * 	capacity      : 5,
 * 	currentTokens : 3
 * }
 * </pre>
 */
public final class ToStringBuilder
{
	private final String name;
	private final List<Entry<String, String>> properties = new ArrayList<>();

	/**
	 * Creates a new builder.
	 *
	 * @param aClass the type of object being described
	 * @throws NullPointerException if {@code aClass} is null
	 */
	public ToStringBuilder(Class<?> aClass)
	{
		checkNotNull(aClass, "aClass");
		this.name = getNestedName(aClass);
	}

	/**
	 * @param aClass a class
	 * @return the simple names of {@code aClass} and its enclosing classes, separated by dots
	 */
	private static String getNestedName(Class<?> aClass)
	{
		String result = aClass.getSimpleName();
		for (Class<?> enclosing = aClass.getEnclosingClass(); enclosing != null;
		     enclosing = enclosing.getEnclosingClass())
		{
			result = enclosing.getSimpleName() + "." + result;
		}
		return result;
	}

	/**
	 * Adds a property.
	 *
	 * @param name  the name of the property
	 * @param value the value of the property
	 * @return this
	 * @throws NullPointerException     if {@code name} is null
	 * @throws IllegalArgumentException if {@code name} is blank
	 */
	public ToStringBuilder add(String name, Object value)
	{
		checkNotNull(name, "name");
		checkArgument(!name.isBlank(), "name may not be blank");
		String text;
		if (value instanceof Map<?, ?> map)
			text = toString(map);
		else
			text = String.valueOf(value);
		properties.add(new SimpleImmutableEntry<>(name, text));
		return this;
	}

	/**
	 * @param map a map
	 * @return the String representation of {@code map}, one entry per line
	 */
	private static String toString(Map<?, ?> map)
	{
		if (map.isEmpty())
			return "{}";
		StringJoiner joiner = new StringJoiner(",\n", "{\n", "\n}");
		for (Entry<?, ?> entry : map.entrySet())
			joiner.add("\t" + (entry.getKey() + ": " + entry.getValue()).replace("\n", "\n\t"));
		return joiner.toString();
	}

	@Override
	public String toString()
	{
		int maxNameLength = 0;
		for (Entry<String, String> property : properties)
			maxNameLength = Math.max(maxNameLength, property.getKey().length());

		StringJoiner output = new StringJoiner(",\n");
		for (Entry<String, String> property : properties)
		{
			String key = property.getKey();
			String padding = " ".repeat(maxNameLength - key.length());
			output.add(key + padding + ": " + property.getValue());
		}
		return name + "\n" +
			"{\n" +
			"\t" + output.toString().replace("\n", "\n\t") + "\n" +
			"}";
	}
}
