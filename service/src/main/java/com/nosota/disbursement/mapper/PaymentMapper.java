package com.nosota.disbursement.mapper;

import com.nosota.disbursement.api.dto.PaymentStatusHistoryDTO;
import com.nosota.disbursement.api.response.PaymentResponse;
import com.nosota.disbursement.model.Payment;
import com.nosota.disbursement.model.PaymentStatusHistoryEntry;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface PaymentMapper {

    PaymentMapper INSTANCE = Mappers.getMapper(PaymentMapper.class);

    PaymentResponse toResponse(Payment payment);

    PaymentStatusHistoryDTO toDTO(PaymentStatusHistoryEntry entry);

    List<PaymentStatusHistoryDTO> toDTOList(List<PaymentStatusHistoryEntry> entries);
}
