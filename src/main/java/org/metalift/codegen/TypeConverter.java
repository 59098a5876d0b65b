package org.metalift.codegen;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.llvm.LLVM.LLVMContextRef;
import org.bytedeco.llvm.LLVM.LLVMTypeRef;
import org.metalift.error.UnsupportedTypeException;
import org.metalift.semantic.type.Type;

import java.util.List;
import java.util.stream.Collectors;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Maps type descriptors onto the native representation used to pass values across the JIT boundary.
 */
public class TypeConverter
{
	/**
	 * Native value kinds that can be marshaled. Only 32-bit signed integers for now.
	 */
	public enum NativeType
	{
		I32;

		public LLVMTypeRef toLLVMType(LLVMContextRef context)
		{
			return switch (this)
			{
				case I32 -> LLVMInt32TypeInContext(context);
			};
		}

		public boolean matches(LLVMTypeRef llvmType)
		{
			return switch (this)
			{
				case I32 -> LLVMGetTypeKind(llvmType) == LLVMIntegerTypeKind && LLVMGetIntTypeWidth(llvmType) == 32;
			};
		}

		/**
		 * Converts a Java argument into the raw native value.
		 */
		public int toNative(Object value)
		{
			return switch (this)
			{
				case I32 -> ((Number) value).intValue();
			};
		}

		/**
		 * Converts a raw native result into its Java value.
		 */
		public Object fromNative(int raw)
		{
			return switch (this)
			{
				case I32 -> raw;
			};
		}
	}

	public static NativeType toNativeType(Type type)
	{
		if (type.isInteger())
		{
			return NativeType.I32;
		}
		throw new UnsupportedTypeException(type, "native marshaling");
	}

	public static List<NativeType> toNativeTypes(List<Type> types)
	{
		return types.stream().map(TypeConverter::toNativeType).collect(Collectors.toList());
	}

	/**
	 * @return The textual IR form of {@code type}, for diagnostics.
	 */
	public static String describe(LLVMTypeRef type)
	{
		BytePointer text = LLVMPrintTypeToString(type);
		String result = text.getString();
		LLVMDisposeMessage(text);
		return result;
	}
}
