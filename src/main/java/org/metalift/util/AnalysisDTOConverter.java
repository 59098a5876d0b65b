package org.metalift.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.metalift.dto.AnalysisDTO;
import org.metalift.error.UnsupportedAnnotationException;
import org.metalift.error.UnsupportedTypeException;
import org.metalift.dto.ParameterDTO;
import org.metalift.ir.Var;
import org.metalift.semantic.AnalysisDescriptor;
import org.metalift.semantic.type.Type;
import org.metalift.semantic.type.TypeResolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts analysis descriptors to and from their JSON form. Type names are resolved
 * through the given {@link TypeResolver}.
 */
public class AnalysisDTOConverter
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	public static AnalysisDescriptor load(Path file, TypeResolver resolver) throws IOException
	{
		Debug.logDebug("Loading analysis descriptor: " + file);
		return fromJson(Files.readString(file), resolver);
	}

	public static AnalysisDescriptor fromJson(String json, TypeResolver resolver)
	{
		AnalysisDTO dto = GSON.fromJson(json, AnalysisDTO.class);
		if (dto == null || dto.name == null || dto.returnType == null)
		{
			throw new JsonParseException("Analysis descriptor requires 'name' and 'returnType'");
		}
		return fromDTO(dto, resolver);
	}

	public static AnalysisDescriptor fromDTO(AnalysisDTO dto, TypeResolver resolver)
	{
		List<Var> arguments = new ArrayList<>();
		if (dto.arguments != null)
		{
			for (int i = 0; i < dto.arguments.size(); i++)
			{
				ParameterDTO pd = dto.arguments.get(i);
				if (pd == null || pd.type == null)
				{
					throw new JsonParseException("Argument " + i + " of " + dto.name + " has no 'type'");
				}
				String argName = pd.name != null ? pd.name : "arg" + i;
				arguments.add(new Var(argName, resolveType(pd.type, resolver)));
			}
		}
		return new AnalysisDescriptor(dto.name, arguments, resolveType(dto.returnType, resolver));
	}

	private static Type resolveType(String name, TypeResolver resolver)
	{
		try
		{
			return resolver.resolveName(name);
		}
		catch (UnsupportedAnnotationException e)
		{
			throw new UnsupportedTypeException(name, "descriptor", e);
		}
	}

	public static AnalysisDTO toDTO(AnalysisDescriptor descriptor)
	{
		AnalysisDTO dto = new AnalysisDTO();
		dto.name = descriptor.getName();
		dto.returnType = descriptor.getReturnType().getName();
		for (Var argument : descriptor.getArguments())
		{
			ParameterDTO pd = new ParameterDTO();
			pd.name = argument.getName();
			pd.type = argument.getType().getName();
			dto.arguments.add(pd);
		}
		return dto;
	}

	public static String toJson(AnalysisDescriptor descriptor)
	{
		return GSON.toJson(toDTO(descriptor));
	}
}
