package org.metalift.codegen;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.Pointer;
import org.bytedeco.llvm.LLVM.LLVMMemoryBufferRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.metalift.error.NativeCompilationException;
import org.metalift.semantic.AnalysisDescriptor;
import org.metalift.util.Debug;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Compiles textual LLVM IR modules into callable functions.
 * <p>
 * Every compilation loads its module into the same {@link ExecutionEngineContext}; by default the
 * process-wide shared one, which is only created when the first module is compiled.
 */
public class NativeCompiler
{
	private final ExecutionEngineContext engine;

	public NativeCompiler()
	{
		this(null);
	}

	/**
	 * @param engine The engine to load modules into, or {@code null} for the shared engine.
	 */
	public NativeCompiler(ExecutionEngineContext engine)
	{
		this.engine = engine;
	}

	private ExecutionEngineContext engine()
	{
		return engine != null ? engine : ExecutionEngineContext.shared();
	}

	public NativeFunction compileFile(Path moduleFile, AnalysisDescriptor descriptor) throws IOException
	{
		Debug.logDebug("Reading module: " + moduleFile);
		return compile(Files.readString(moduleFile, StandardCharsets.UTF_8), descriptor);
	}

	/**
	 * Parses, verifies and loads {@code moduleText}, then returns a handle to the function
	 * named by {@code descriptor}.
	 *
	 * @throws org.metalift.error.UnsupportedTypeException if a descriptor type cannot be marshaled.
	 * @throws NativeCompilationException if the module is invalid or its function does not match the descriptor.
	 */
	public NativeFunction compile(String moduleText, AnalysisDescriptor descriptor)
	{
		// Marshaling is fixed before any native work, so unsupported types fail here
		List<TypeConverter.NativeType> parameters = TypeConverter.toNativeTypes(descriptor.getArgumentTypes());
		TypeConverter.NativeType returnType = TypeConverter.toNativeType(descriptor.getReturnType());

		ExecutionEngineContext ctx = engine();
		synchronized (ctx.getLock())
		{
			LLVMModuleRef module = parse(ctx, moduleText, descriptor.getName());
			LLVMValueRef entry;
			String entryName = ctx.nextEntryName(descriptor.getName());
			try
			{
				verify(module);
				checkNoRedefinitions(ctx, module);
				EntryThunkBuilder thunks = new EntryThunkBuilder(ctx.getContext(), module);
				LLVMValueRef target = thunks.resolveTarget(descriptor.getName(), parameters, returnType);
				entry = thunks.build(entryName, target, parameters);
				verify(module);
			}
			catch (RuntimeException e)
			{
				LLVMDisposeModule(module);
				throw e;
			}

			// The engine owns the module from here on
			long address = ctx.addModule(module, entryName);
			Debug.logDebug("Loaded " + descriptor + " at entry 0x" + Long.toHexString(address));
			return new JitFunction(ctx, descriptor, entry, LLVMInt32TypeInContext(ctx.getContext()),
					parameters, returnType, address);
		}
	}

	private static LLVMModuleRef parse(ExecutionEngineContext ctx, String moduleText, String name)
	{
		byte[] bytes = moduleText.getBytes(StandardCharsets.UTF_8);
		BytePointer text = new BytePointer(bytes);
		LLVMMemoryBufferRef buffer = LLVMCreateMemoryBufferWithMemoryRangeCopy(text, bytes.length, new BytePointer(name));

		LLVMModuleRef module = new LLVMModuleRef();
		BytePointer error = new BytePointer((Pointer) null);
		// Takes ownership of the buffer, whether or not parsing succeeds
		if (LLVMParseIRInContext(ctx.getContext(), buffer, module, error) != 0)
		{
			String message = error.getString();
			LLVMDisposeMessage(error);
			throw new NativeCompilationException("Failed to parse module: " + message.trim());
		}
		return module;
	}

	/**
	 * Symbols are global to the engine and modules are never unloaded, so a function defined
	 * by an earlier module cannot be defined again.
	 */
	private static void checkNoRedefinitions(ExecutionEngineContext ctx, LLVMModuleRef module)
	{
		for (LLVMValueRef fn = LLVMGetFirstFunction(module); fn != null && !fn.isNull(); fn = LLVMGetNextFunction(fn))
		{
			if (LLVMIsDeclaration(fn) != 0 || LLVMGetLinkage(fn) == LLVMInternalLinkage || LLVMGetLinkage(fn) == LLVMPrivateLinkage)
			{
				continue;
			}
			String name = LLVMGetValueName(fn).getString();
			if (ctx.definesFunction(name))
			{
				throw new NativeCompilationException("Function '" + name + "' is already defined by a previously loaded module");
			}
		}
	}

	private static void verify(LLVMModuleRef module)
	{
		BytePointer error = new BytePointer((Pointer) null);
		if (LLVMVerifyModule(module, LLVMReturnStatusAction, error) != 0)
		{
			String message = error.getString();
			LLVMDisposeMessage(error);
			throw new NativeCompilationException("Module verification failed: " + message.trim());
		}
		LLVMDisposeMessage(error);
	}
}
