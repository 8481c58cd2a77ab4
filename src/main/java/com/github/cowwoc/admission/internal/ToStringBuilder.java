package com.github.cowwoc.admission.internal;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;
import java.util.StringJoiner;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Standardizes the format of toString() return values.
 */
public final class ToStringBuilder
{
	private final String name;
	private final List<Entry<String, String>> properties = new ArrayList<>();

	/**
	 * Creates a new builder.
	 *
	 * @param aClass the type of object being processed
	 * @throws NullPointerException if {@code aClass} is null
	 */
	public ToStringBuilder(Class<?> aClass)
	{
		requireThat(aClass, "aClass").isNotNull();
		this.name = aClass.getSimpleName();
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
		if (value instanceof List<?> list)
			return add(name, list);
		requireThat(name, "name").isNotBlank();
		properties.add(new SimpleImmutableEntry<>(name, String.valueOf(value)));
		return this;
	}

	/**
	 * Adds a property.
	 *
	 * @param name the name of the property
	 * @param list the value of the property
	 * @return this
	 * @throws NullPointerException     if {@code name} is null
	 * @throws IllegalArgumentException if {@code name} is blank
	 */
	public ToStringBuilder add(String name, List<?> list)
	{
		requireThat(name, "name").isNotBlank();
		StringJoiner joiner = new StringJoiner(", ", "[", "]");
		for (Object element : list)
			joiner.add(String.valueOf(element));
		properties.add(new SimpleImmutableEntry<>(name, joiner.toString()));
		return this;
	}

	/**
	 * Returns the String representation of this {@code ToStringBuilder}.
	 *
	 * @return {@code Name[first=value, second=value]}
	 */
	@Override
	public String toString()
	{
		StringJoiner output = new StringJoiner(", ", name + "[", "]");
		for (Entry<String, String> entry : properties)
			output.add(entry.getKey() + "=" + entry.getValue());
		return output.toString();
	}
}
