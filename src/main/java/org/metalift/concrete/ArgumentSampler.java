package org.metalift.concrete;

import org.metalift.error.UnsupportedTypeException;
import org.metalift.semantic.AnalysisDescriptor;
import org.metalift.semantic.type.PrimitiveType;
import org.metalift.semantic.type.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Draws random, boundary-biased argument values for typed parameter lists.
 */
public class ArgumentSampler
{
	public enum SamplingClass
	{
		FULL_RANGE,
		SMALL_RANGE,
		SPECIAL
	}

	public static final int SMALL_RANGE_BOUND = 13;

	private static final int[] SPECIAL_INTS = {-1, 1, 0, PrimitiveType.MIN_INT, PrimitiveType.MAX_INT};

	private final Random random;

	public ArgumentSampler(Random random)
	{
		this.random = Objects.requireNonNull(random, "random");
	}

	/**
	 * One value for each type, in order.
	 */
	public List<Object> sample(List<Type> types)
	{
		List<Object> values = new ArrayList<>(types.size());
		for (Type type : types)
		{
			values.add(sample(type));
		}
		return values;
	}

	public List<Object> sampleArguments(AnalysisDescriptor descriptor)
	{
		return sample(descriptor.getArgumentTypes());
	}

	public Object sample(Type type)
	{
		if (type.isInteger())
		{
			return sampleInt();
		}
		throw new UnsupportedTypeException(type, "sampling");
	}

	public int sampleInt()
	{
		SamplingClass[] classes = SamplingClass.values();
		return sampleInt(classes[random.nextInt(classes.length)]);
	}

	public int sampleInt(SamplingClass samplingClass)
	{
		return switch (samplingClass)
		{
			case FULL_RANGE -> random.nextInt();
			case SMALL_RANGE -> random.nextInt(2 * SMALL_RANGE_BOUND + 1) - SMALL_RANGE_BOUND;
			case SPECIAL -> SPECIAL_INTS[random.nextInt(SPECIAL_INTS.length)];
		};
	}
}
