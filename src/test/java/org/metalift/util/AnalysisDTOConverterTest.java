package org.metalift.util;

import com.google.gson.JsonParseException;
import org.metalift.error.ErrorKind;
import org.metalift.error.UnsupportedTypeException;
import org.metalift.ir.Var;
import org.metalift.semantic.AnalysisDescriptor;
import org.metalift.semantic.type.PrimitiveType;
import org.metalift.semantic.type.TypeEnvironment;
import org.metalift.semantic.type.TypeResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisDTOConverterTest
{
	private final TypeResolver resolver = new TypeResolver(TypeEnvironment.standard());

	@Test
	void readsDescriptorJson()
	{
		String json = "{\"name\": \"f\", \"arguments\": [{\"name\": \"x\", \"type\": \"Int\"}, {\"name\": \"y\", \"type\": \"int\"}],"
				+ " \"returnType\": \"Int\"}";

		AnalysisDescriptor descriptor = AnalysisDTOConverter.fromJson(json, resolver);

		assertEquals("f", descriptor.getName());
		assertEquals(List.of(new Var("x", PrimitiveType.INT), new Var("y", PrimitiveType.INT)), descriptor.getArguments());
		assertEquals(PrimitiveType.INT, descriptor.getReturnType());
		assertEquals(2, descriptor.getArity());
	}

	@Test
	void unnamedArgumentsArePositional()
	{
		AnalysisDescriptor descriptor = AnalysisDTOConverter.fromJson(
				"{\"name\": \"g\", \"arguments\": [{\"type\": \"Int\"}], \"returnType\": \"Bool\"}", resolver);

		assertEquals(new Var("arg0", PrimitiveType.INT), descriptor.getArguments().get(0));
		assertEquals(PrimitiveType.BOOL, descriptor.getReturnType());
	}

	@Test
	void writesWhatItReads()
	{
		AnalysisDescriptor descriptor = new AnalysisDescriptor("h",
				List.of(new Var("a", PrimitiveType.INT)), PrimitiveType.INT);

		String json = AnalysisDTOConverter.toJson(descriptor);

		assertTrue(json.contains("\"returnType\": \"Int\""));
		assertEquals(descriptor, AnalysisDTOConverter.fromJson(json, resolver));
	}

	@Test
	void incompleteDescriptorsAreRejected()
	{
		assertThrows(JsonParseException.class, () -> AnalysisDTOConverter.fromJson("{\"name\": \"f\"}", resolver));
		assertThrows(JsonParseException.class, () -> AnalysisDTOConverter.fromJson(
				"{\"name\": \"f\", \"arguments\": [{\"name\": \"x\"}], \"returnType\": \"Int\"}", resolver));
	}

	@Test
	void unknownTypeNamesAreRejected()
	{
		UnsupportedTypeException e = assertThrows(UnsupportedTypeException.class, () -> AnalysisDTOConverter.fromJson(
				"{\"name\": \"f\", \"arguments\": [], \"returnType\": \"Float\"}", resolver));
		assertEquals(ErrorKind.UNSUPPORTED_TYPE, e.getKind());
		assertTrue(e.getMessage().contains("Float"));
	}

	@Test
	void parametricTypeNamesNeedArguments()
	{
		// Only bare names are accepted in descriptor files
		assertThrows(UnsupportedTypeException.class, () -> AnalysisDTOConverter.fromJson(
				"{\"name\": \"f\", \"arguments\": [{\"name\": \"xs\", \"type\": \"List\"}], \"returnType\": \"Int\"}", resolver));
	}

	@Test
	void loadsDescriptorFiles(@TempDir Path dir) throws IOException
	{
		Path file = dir.resolve("f.json");
		Files.writeString(file, "{\"name\": \"f\", \"arguments\": [], \"returnType\": \"Int\"}");

		assertEquals(new AnalysisDescriptor("f", List.of(), PrimitiveType.INT), AnalysisDTOConverter.load(file, resolver));
	}
}
