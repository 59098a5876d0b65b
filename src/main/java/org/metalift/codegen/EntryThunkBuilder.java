package org.metalift.codegen;

import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.LLVMBasicBlockRef;
import org.bytedeco.llvm.LLVM.LLVMBuilderRef;
import org.bytedeco.llvm.LLVM.LLVMContextRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;
import org.bytedeco.llvm.LLVM.LLVMTypeRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.metalift.error.NativeCompilationException;
import org.metalift.util.Debug;

import java.util.List;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Emits a uniform entry point {@code i32 entry(i32 count, ptr args)} next to a target function.
 * The entry loads each argument from the {@code args} buffer and forwards the call, so every
 * compiled function can be invoked through the same execution-engine signature.
 */
public class EntryThunkBuilder
{
	private final LLVMContextRef context;
	private final LLVMModuleRef module;

	public EntryThunkBuilder(LLVMContextRef context, LLVMModuleRef module)
	{
		this.context = context;
		this.module = module;
	}

	/**
	 * Finds {@code functionName} in the module and checks it against the expected signature.
	 */
	public LLVMValueRef resolveTarget(String functionName, List<TypeConverter.NativeType> parameters, TypeConverter.NativeType returnType)
	{
		LLVMValueRef target = LLVMGetNamedFunction(module, functionName);
		if (target == null || target.isNull())
		{
			throw new NativeCompilationException("Module does not define function '" + functionName + "'");
		}
		if (LLVMIsDeclaration(target) != 0)
		{
			throw new NativeCompilationException("Function '" + functionName + "' is declared but has no body");
		}

		LLVMTypeRef fnType = LLVMGlobalGetValueType(target);
		if (LLVMIsFunctionVarArg(fnType) != 0)
		{
			throw new NativeCompilationException("Function '" + functionName + "' is variadic");
		}

		int paramCount = LLVMCountParams(target);
		if (paramCount != parameters.size())
		{
			throw new NativeCompilationException("Function '" + functionName + "' takes " + paramCount
					+ " parameter(s) but the descriptor declares " + parameters.size());
		}
		for (int i = 0; i < paramCount; i++)
		{
			LLVMTypeRef actual = LLVMTypeOf(LLVMGetParam(target, i));
			if (!parameters.get(i).matches(actual))
			{
				throw new NativeCompilationException("Parameter " + i + " of '" + functionName + "' has type "
						+ TypeConverter.describe(actual) + ", expected " + parameters.get(i));
			}
		}

		LLVMTypeRef actualReturn = LLVMGetReturnType(fnType);
		if (!returnType.matches(actualReturn))
		{
			throw new NativeCompilationException("Function '" + functionName + "' returns "
					+ TypeConverter.describe(actualReturn) + ", expected " + returnType);
		}
		return target;
	}

	/**
	 * Adds the entry thunk for {@code target} under {@code entryName}.
	 */
	public LLVMValueRef build(String entryName, LLVMValueRef target, List<TypeConverter.NativeType> parameters)
	{
		LLVMTypeRef i32 = LLVMInt32TypeInContext(context);
		LLVMTypeRef i64 = LLVMInt64TypeInContext(context);
		LLVMTypeRef ptr = LLVMPointerTypeInContext(context, 0);

		LLVMTypeRef[] thunkParams = {i32, ptr};
		LLVMTypeRef thunkType = LLVMFunctionType(i32, new PointerPointer<>(thunkParams), thunkParams.length, 0);
		LLVMValueRef thunk = LLVMAddFunction(module, entryName, thunkType);

		LLVMBasicBlockRef entry = LLVMAppendBasicBlockInContext(context, thunk, "entry");
		LLVMBuilderRef builder = LLVMCreateBuilderInContext(context);
		try
		{
			LLVMPositionBuilderAtEnd(builder, entry);
			LLVMValueRef buffer = LLVMGetParam(thunk, 1);

			LLVMValueRef[] args = new LLVMValueRef[parameters.size()];
			for (int i = 0; i < args.length; i++)
			{
				LLVMTypeRef elementType = parameters.get(i).toLLVMType(context);
				LLVMValueRef[] indices = {LLVMConstInt(i64, i, 0)};
				LLVMValueRef slot = LLVMBuildGEP2(builder, elementType, buffer, new PointerPointer<>(indices), 1, "arg" + i + ".ptr");
				args[i] = LLVMBuildLoad2(builder, elementType, slot, "arg" + i);
			}

			LLVMValueRef result = LLVMBuildCall2(builder, LLVMGlobalGetValueType(target), target,
					new PointerPointer<>(args), args.length, "result");
			LLVMBuildRet(builder, result);
		}
		finally
		{
			LLVMDisposeBuilder(builder);
		}

		Debug.logDebug("Built entry thunk " + entryName + " for " + parameters.size() + " argument(s).");
		return thunk;
	}
}
