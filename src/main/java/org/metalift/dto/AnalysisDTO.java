package org.metalift.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of an analysis descriptor:
 * {@code {"name": "f", "arguments": [{"name": "x", "type": "Int"}], "returnType": "Int"}}.
 */
public class AnalysisDTO
{
	public String name;
	public List<ParameterDTO> arguments = new ArrayList<>();
	public String returnType;
}
