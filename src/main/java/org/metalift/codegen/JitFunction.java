package org.metalift.codegen;

import org.bytedeco.javacpp.IntPointer;
import org.bytedeco.llvm.LLVM.LLVMTypeRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.metalift.semantic.AnalysisDescriptor;

import java.util.List;

/**
 * A function loaded into an {@link ExecutionEngineContext}, called through its entry thunk.
 * Safe to call from several threads; each call marshals into its own argument buffer.
 */
public class JitFunction implements NativeFunction
{
	private final ExecutionEngineContext engine;
	private final AnalysisDescriptor descriptor;
	private final LLVMValueRef entry;
	private final LLVMTypeRef countType;
	private final List<TypeConverter.NativeType> parameters;
	private final TypeConverter.NativeType returnType;
	private final long address;

	JitFunction(ExecutionEngineContext engine, AnalysisDescriptor descriptor, LLVMValueRef entry, LLVMTypeRef countType,
				List<TypeConverter.NativeType> parameters, TypeConverter.NativeType returnType, long address)
	{
		this.engine = engine;
		this.descriptor = descriptor;
		this.entry = entry;
		this.countType = countType;
		this.parameters = List.copyOf(parameters);
		this.returnType = returnType;
		this.address = address;
	}

	@Override
	public Object invoke(Object... arguments)
	{
		int arity = parameters.size();
		if (arguments.length != arity)
		{
			throw new IllegalArgumentException(descriptor.getName() + " expects " + arity
					+ " argument(s) but got " + arguments.length);
		}

		try (IntPointer buffer = new IntPointer(Math.max(1, arity)))
		{
			for (int i = 0; i < arity; i++)
			{
				buffer.put(i, parameters.get(i).toNative(arguments[i]));
			}
			int raw = engine.runEntry(entry, countType, arity, buffer);
			return returnType.fromNative(raw);
		}
	}

	public AnalysisDescriptor getDescriptor()
	{
		return descriptor;
	}

	/**
	 * @return The native address of the entry thunk.
	 */
	public long getEntryAddress()
	{
		return address;
	}

	@Override
	public String toString()
	{
		return "JitFunction[" + descriptor + "]";
	}
}
