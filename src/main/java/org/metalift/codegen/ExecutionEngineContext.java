package org.metalift.codegen;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.Pointer;
import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.LLVMContextRef;
import org.bytedeco.llvm.LLVM.LLVMExecutionEngineRef;
import org.bytedeco.llvm.LLVM.LLVMGenericValueRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;
import org.bytedeco.llvm.LLVM.LLVMTypeRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.metalift.error.NativeCompilationException;
import org.metalift.util.Debug;

import java.util.concurrent.atomic.AtomicLong;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * A JIT execution engine together with the LLVM context its modules live in.
 * <p>
 * The engine is reusable for an arbitrary number of modules. Modules are only ever added:
 * there is no unload path, and a symbol defined by an earlier module stays visible.
 * Loading and finalizing modules must not interleave, so compilations synchronize on
 * {@link #getLock()}. Running already compiled functions does not take the lock.
 * <p>
 * {@link #shared()} is the process-wide instance, created on first use and never disposed.
 * Instances created with {@link #create()} are disposed by {@link #close()}, together with
 * every module they loaded.
 */
public class ExecutionEngineContext implements AutoCloseable
{
	// STATIC INITIALIZER BLOCK
	static
	{
		LLVMLinkInMCJIT();
		LLVMInitializeAllTargetInfos();
		LLVMInitializeAllTargets();
		LLVMInitializeAllTargetMCs();
		LLVMInitializeAllAsmParsers();
		LLVMInitializeAllAsmPrinters();
		Debug.logDebug("LLVM Subsystems Initialized.");
	}

	private static final int OPT_LEVEL = 2;
	private static volatile ExecutionEngineContext shared;

	private final Object lock = new Object();
	private final AtomicLong entryCounter = new AtomicLong();
	private final boolean isShared;
	private final LLVMContextRef context;
	private final LLVMExecutionEngineRef engine;
	private volatile boolean closed = false;

	private ExecutionEngineContext(boolean isShared)
	{
		this.isShared = isShared;
		this.context = LLVMContextCreate();

		// An execution engine with an empty backing module
		LLVMModuleRef backing = LLVMModuleCreateWithNameInContext("metalift_backing", context);
		LLVMExecutionEngineRef newEngine = new LLVMExecutionEngineRef();
		BytePointer error = new BytePointer((Pointer) null);
		if (LLVMCreateJITCompilerForModule(newEngine, backing, OPT_LEVEL, error) != 0)
		{
			String message = error.getString();
			LLVMDisposeMessage(error);
			LLVMDisposeModule(backing);
			LLVMContextDispose(context);
			throw new NativeCompilationException("Failed to create execution engine: " + message);
		}
		this.engine = newEngine;
		Debug.logDebug("Created " + (isShared ? "shared " : "") + "JIT execution engine.");
	}

	/**
	 * @return The process-wide context, created on the first call.
	 */
	public static ExecutionEngineContext shared()
	{
		ExecutionEngineContext instance = shared;
		if (instance == null)
		{
			synchronized (ExecutionEngineContext.class)
			{
				instance = shared;
				if (instance == null)
				{
					instance = new ExecutionEngineContext(true);
					shared = instance;
				}
			}
		}
		return instance;
	}

	/**
	 * @return A new, independent context owned by the caller.
	 */
	public static ExecutionEngineContext create()
	{
		return new ExecutionEngineContext(false);
	}

	public Object getLock()
	{
		return lock;
	}

	public LLVMContextRef getContext()
	{
		ensureOpen();
		return context;
	}

	public boolean isShared()
	{
		return isShared;
	}

	public boolean isClosed()
	{
		return closed;
	}

	/**
	 * @return A symbol name not used by any earlier module of this engine.
	 */
	String nextEntryName(String functionName)
	{
		return "__metalift_entry_" + functionName + "_" + entryCounter.incrementAndGet();
	}

	/**
	 * @return Whether a module already loaded into this engine defines {@code name}.
	 */
	boolean definesFunction(String name)
	{
		ensureOpen();
		LLVMValueRef found = new LLVMValueRef();
		return LLVMFindFunction(engine, new BytePointer(name), found) == 0;
	}

	/**
	 * Hands {@code module} over to the engine, finalizes it and runs static constructors.
	 * Must be called while holding {@link #getLock()}.
	 *
	 * @return The address of {@code entrySymbol}.
	 */
	long addModule(LLVMModuleRef module, String entrySymbol)
	{
		ensureOpen();
		LLVMAddModule(engine, module);

		// Looking up an address finalizes every pending module
		long address = LLVMGetFunctionAddress(engine, entrySymbol);
		if (address == 0)
		{
			throw new NativeCompilationException("Symbol " + entrySymbol + " could not be resolved after loading the module");
		}
		LLVMRunStaticConstructors(engine);
		return address;
	}

	/**
	 * Calls an entry thunk of signature {@code i32 (i32, ptr)}.
	 */
	int runEntry(LLVMValueRef entry, LLVMTypeRef i32, int arity, Pointer arguments)
	{
		ensureOpen();
		LLVMGenericValueRef count = LLVMCreateGenericValueOfInt(i32, arity, 0);
		LLVMGenericValueRef buffer = LLVMCreateGenericValueOfPointer(arguments);
		LLVMGenericValueRef result = null;
		try
		{
			result = LLVMRunFunction(engine, entry, 2, new PointerPointer<>(count, buffer));
			return (int) LLVMGenericValueToInt(result, 1);
		}
		finally
		{
			LLVMDisposeGenericValue(count);
			LLVMDisposeGenericValue(buffer);
			if (result != null)
			{
				LLVMDisposeGenericValue(result);
			}
		}
	}

	private void ensureOpen()
	{
		if (closed)
		{
			throw new IllegalStateException("Execution engine context has been closed");
		}
	}

	/**
	 * Disposes the engine, every module it loaded and the LLVM context. Functions compiled
	 * through this context must not be called afterwards. Closing the shared context does nothing.
	 */
	@Override
	public void close()
	{
		if (isShared)
		{
			Debug.logDebug("The shared execution engine lives until the process exits; close() ignored.");
			return;
		}
		synchronized (lock)
		{
			if (closed)
			{
				return;
			}
			closed = true;
			LLVMDisposeExecutionEngine(engine);
			LLVMContextDispose(context);
			Debug.logDebug("Disposed JIT execution engine.");
		}
	}
}
