package org.metalift.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;
import org.metalift.concrete.Trace;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Serializes traces as a JSON array of {@code [output, [input, ...]]} pairs.
 */
public class TraceWriter
{
	private static final Gson GSON = new GsonBuilder().create();

	public static JsonArray toJsonTree(List<Trace> traces)
	{
		JsonArray array = new JsonArray();
		for (Trace trace : traces)
		{
			JsonArray inputs = new JsonArray();
			for (Object input : trace.getInputs())
			{
				inputs.add(toJsonValue(input));
			}
			JsonArray record = new JsonArray();
			record.add(toJsonValue(trace.getOutput()));
			record.add(inputs);
			array.add(record);
		}
		return array;
	}

	public static String toJson(List<Trace> traces)
	{
		return GSON.toJson(toJsonTree(traces));
	}

	public static void write(List<Trace> traces, Path file) throws IOException
	{
		Files.writeString(file, toJson(traces), StandardCharsets.UTF_8);
		Debug.logDebug("Wrote " + traces.size() + " trace(s) to " + file);
	}

	private static JsonElement toJsonValue(Object value)
	{
		if (value == null)
		{
			return JsonNull.INSTANCE;
		}
		if (value instanceof Number n)
		{
			return new JsonPrimitive(n);
		}
		if (value instanceof Boolean b)
		{
			return new JsonPrimitive(b);
		}
		return GSON.toJsonTree(value);
	}
}
