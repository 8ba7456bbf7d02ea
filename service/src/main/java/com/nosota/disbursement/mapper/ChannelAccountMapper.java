package com.nosota.disbursement.mapper;

import com.nosota.disbursement.api.dto.ChannelAccountDTO;
import com.nosota.disbursement.model.ChannelAccount;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for ChannelAccount entity to ChannelAccountDTO conversion.
 * Key material is not part of the DTO.
 */
@Mapper
public interface ChannelAccountMapper {

    ChannelAccountMapper INSTANCE = Mappers.getMapper(ChannelAccountMapper.class);

    ChannelAccountDTO toDTO(ChannelAccount channelAccount);

    List<ChannelAccountDTO> toDTOList(List<ChannelAccount> channelAccounts);
}
